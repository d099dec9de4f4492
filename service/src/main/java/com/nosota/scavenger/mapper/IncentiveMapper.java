package com.nosota.scavenger.mapper;

import com.nosota.scavenger.api.response.IncentiveResponse;
import com.nosota.scavenger.model.IncentiveProgram;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface IncentiveMapper {

    IncentiveMapper INSTANCE = Mappers.getMapper(IncentiveMapper.class);

    IncentiveResponse toResponse(IncentiveProgram program);

    List<IncentiveResponse> toResponseList(List<IncentiveProgram> programs);
}
