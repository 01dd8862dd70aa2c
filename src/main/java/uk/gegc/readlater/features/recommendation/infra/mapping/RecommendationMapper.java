package uk.gegc.readlater.features.recommendation.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.readlater.features.recommendation.api.dto.RecommendationDto;
import uk.gegc.readlater.features.recommendation.domain.model.Recommendation;

import java.util.Collection;
import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface RecommendationMapper {

    @Mapping(target = "recommenderId", source = "recommender.id")
    @Mapping(target = "recommenderName", source = "recommender.name")
    @Mapping(target = "recommenderUsername", source = "recommender.profile.username")
    @Mapping(target = "recommenderPictureUrl", source = "recommender.profile.pictureUrl")
    @Mapping(target = "groupId", source = "group.id")
    @Mapping(target = "groupName", source = "group.name")
    @Mapping(target = "recommendedAt", source = "createdAt")
    RecommendationDto toDto(Recommendation entity);

    List<RecommendationDto> toDtos(Collection<Recommendation> entities);
}
