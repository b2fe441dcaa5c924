package com.gridtrader.mapper;

import com.gridtrader.domain.model.GridOrder;
import com.gridtrader.entity.GridOrderEntity;
import org.mapstruct.Mapper;

/** MapStruct mapper between GridOrder and GridOrderEntity. */
@Mapper
public interface GridOrderMapper {

    GridOrderEntity toEntity(GridOrder order);

    GridOrder toDomain(GridOrderEntity entity);
}
