package uk.gegc.readlater.features.label.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.readlater.features.label.api.dto.LabelDto;
import uk.gegc.readlater.features.label.domain.model.Label;

import java.util.Collection;
import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface LabelMapper {
    LabelDto toDto(Label entity);
    List<LabelDto> toDtos(Collection<Label> entities);
}
