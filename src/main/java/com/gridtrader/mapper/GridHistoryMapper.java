package com.gridtrader.mapper;

import com.gridtrader.domain.model.GridSnapshot;
import com.gridtrader.entity.GridHistoryEntity;
import org.mapstruct.Mapper;

@Mapper
public interface GridHistoryMapper {

    GridHistoryEntity toEntity(GridSnapshot snapshot);

    GridSnapshot toDomain(GridHistoryEntity entity);
}
