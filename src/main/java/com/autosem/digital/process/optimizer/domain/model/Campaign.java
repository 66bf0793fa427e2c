package com.autosem.digital.process.optimizer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Document(collection = "campaigns")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {
    @Id
    private String id;
    private String name;
    private Platform platform;
    private String externalId;          // ID en la plataforma, nulo hasta publicarse
    @Indexed(name = "campaign_status_idx")
    private CampaignStatus status;
    private BigDecimal dailyBudget;     // Presupuesto diario en dólares (2 decimales)

    // Contadores acumulados desde la creación de la campaña
    private Long impressions;
    private Long clicks;
    private Long conversions;
    private BigDecimal spend;
    private BigDecimal revenue;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Version
    private Long version;
}
