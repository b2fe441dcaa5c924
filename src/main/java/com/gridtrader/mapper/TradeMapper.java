package com.gridtrader.mapper;

import com.gridtrader.domain.model.Trade;
import com.gridtrader.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Trade and TradeEntity. New rows always get a generated id, and a
 * missing fee is stored as zero.
 */
@Mapper
public interface TradeMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "fee", source = "fee", defaultValue = "0")
    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
