package uk.gegc.readlater.features.highlight.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.readlater.features.highlight.api.dto.HighlightDto;
import uk.gegc.readlater.features.highlight.domain.model.Highlight;
import uk.gegc.readlater.features.label.infra.mapping.LabelMapper;

import java.util.Collection;
import java.util.List;

@Mapper(componentModel = "spring", uses = LabelMapper.class, unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface HighlightMapper {

    @Mapping(target = "authorId", source = "user.id")
    @Mapping(target = "authorName", source = "user.name")
    HighlightDto toDto(Highlight entity);

    List<HighlightDto> toDtos(Collection<Highlight> entities);
}
