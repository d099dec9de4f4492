package com.nosota.scavenger.tests;

import com.nosota.scavenger.api.model.WasteType;
import com.nosota.scavenger.model.WasteUnit;
import com.nosota.scavenger.service.WasteRegistryService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
public class AsyncWasteSubmitter {

    private final WasteRegistryService wasteRegistryService;

    @Async("testTaskExecutor")
    public CompletableFuture<Long> submit(String submitter, WasteType category, long weight,
                                          long latitude, long longitude) {
        try {
            WasteUnit waste = wasteRegistryService.submit(category, weight, submitter, latitude, longitude);
            return CompletableFuture.completedFuture(waste.getId());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
