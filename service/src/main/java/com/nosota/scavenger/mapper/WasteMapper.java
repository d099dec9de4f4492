package com.nosota.scavenger.mapper;

import com.nosota.scavenger.api.dto.TransferRecordDTO;
import com.nosota.scavenger.api.response.WasteResponse;
import com.nosota.scavenger.model.TransferRecord;
import com.nosota.scavenger.model.WasteUnit;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface WasteMapper {

    WasteMapper INSTANCE = Mappers.getMapper(WasteMapper.class);

    WasteResponse toResponse(WasteUnit waste);

    List<WasteResponse> toResponseList(List<WasteUnit> wastes);

    @Mapping(source = "fromAddress", target = "from")
    @Mapping(source = "toAddress", target = "to")
    TransferRecordDTO toDTO(TransferRecord record);

    List<TransferRecordDTO> toDTOList(List<TransferRecord> records);
}
