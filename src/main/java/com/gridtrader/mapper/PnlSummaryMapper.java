package com.gridtrader.mapper;

import com.gridtrader.domain.model.PnlSummary;
import com.gridtrader.entity.PnlSummaryEntity;
import org.mapstruct.Mapper;

@Mapper
public interface PnlSummaryMapper {

    PnlSummaryEntity toEntity(PnlSummary summary);

    PnlSummary toDomain(PnlSummaryEntity entity);
}
