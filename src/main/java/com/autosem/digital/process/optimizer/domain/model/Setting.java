package com.autosem.digital.process.optimizer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Par clave/valor de configuración de la cuenta. Sólo lo modifica un operador.
 */
@Document(collection = "settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Setting {
    @Id
    private String id;
    @Indexed(name = "setting_key_idx", unique = true)
    private String key;
    private String value;
    private LocalDateTime updatedDate;
}
