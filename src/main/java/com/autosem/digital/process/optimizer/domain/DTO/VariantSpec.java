package com.autosem.digital.process.optimizer.domain.DTO;

import com.autosem.digital.process.optimizer.domain.model.VariantType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Datos para duplicar el conjunto de anuncios original con el creativo de la variante.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantSpec {
    private String testName;
    private String originalAdId;
    private String originalAdsetId;
    private VariantType variantType;
    private String variantValue;
    private long budgetCents;
}
