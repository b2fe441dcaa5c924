package com.gridtrader.mapper;

import com.gridtrader.domain.model.ActiveConfig;
import com.gridtrader.entity.BotConfigEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper between ActiveConfig and BotConfigEntity. The active flag is owned by the store. */
@Mapper
public interface BotConfigMapper {

    @Mapping(target = "active", ignore = true)
    BotConfigEntity toEntity(ActiveConfig config);

    ActiveConfig toDomain(BotConfigEntity entity);
}
