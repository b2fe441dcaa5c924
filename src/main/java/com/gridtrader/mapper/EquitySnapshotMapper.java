package com.gridtrader.mapper;

import com.gridtrader.domain.model.EquitySnapshot;
import com.gridtrader.entity.EquitySnapshotEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface EquitySnapshotMapper {

    EquitySnapshotEntity toEntity(EquitySnapshot snapshot);

    EquitySnapshot toDomain(EquitySnapshotEntity entity);

    List<EquitySnapshot> toDomainList(List<EquitySnapshotEntity> entities);
}
