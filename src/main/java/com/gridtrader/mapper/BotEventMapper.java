package com.gridtrader.mapper;

import com.gridtrader.domain.model.BotEvent;
import com.gridtrader.entity.BotEventEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between BotEvent and BotEventEntity. The details map is stored as a JSON string.
 */
@Mapper(imports = JsonHelper.class)
public interface BotEventMapper {

    @Mapping(target = "details", expression = "java(JsonHelper.toJson(event.getDetails()))")
    BotEventEntity toEntity(BotEvent event);

    @Mapping(target = "details", expression = "java(JsonHelper.fromJsonMap(entity.getDetails()))")
    BotEvent toDomain(BotEventEntity entity);

    List<BotEvent> toDomainList(List<BotEventEntity> entities);
}
