package uk.gegc.readlater.features.recommendation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "RecommendationDto", description = "Who recommended a library item, and through which group")
public record RecommendationDto(
        @Schema(description = "Recommendation identifier")
        UUID id,

        @Schema(description = "Recommender user id")
        UUID recommenderId,

        @Schema(description = "Recommender display name")
        String recommenderName,

        @Schema(description = "Recommender username from the profile")
        String recommenderUsername,

        @Schema(description = "Recommender profile picture")
        String recommenderPictureUrl,

        @Schema(description = "Group the recommendation was shared through, if any")
        UUID groupId,

        @Schema(description = "Group name, if any")
        String groupName,

        @Schema(description = "Note left by the recommender")
        String note,

        @Schema(description = "When the item was recommended")
        Instant recommendedAt
) {
}
