package com.nosota.scavenger.mapper;

import com.nosota.scavenger.api.response.ParticipantResponse;
import com.nosota.scavenger.model.Participant;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

@Mapper
public interface ParticipantMapper {

    ParticipantMapper INSTANCE = Mappers.getMapper(ParticipantMapper.class);

    ParticipantResponse toResponse(Participant participant);
}
