package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateABTestRequest {
    private String testName;
    private String campaignId;
    private String originalAdId;
    private String originalAdsetId;
    private String variantType;     // headline | image | cta
    private String variantValue;
}
