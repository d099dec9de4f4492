package com.nosota.scavenger.mapper;

import com.nosota.scavenger.api.dto.RewardPayoutDTO;
import com.nosota.scavenger.api.response.SettlementResponse;
import com.nosota.scavenger.dto.RewardDistribution;
import com.nosota.scavenger.model.RewardPayout;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface RewardPayoutMapper {

    RewardPayoutMapper INSTANCE = Mappers.getMapper(RewardPayoutMapper.class);

    RewardPayoutDTO toDTO(RewardPayout payout);

    List<RewardPayoutDTO> toDTOList(List<RewardPayout> payouts);

    @Mapping(source = "remainingBudgetAfter", target = "remainingBudget")
    @Mapping(source = "incentiveActiveAfter", target = "incentiveActive")
    SettlementResponse toSettlementResponse(RewardDistribution distribution);
}
