package com.autosem.digital.process.optimizer.domain.DTO;

import lombok.Getter;
import lombok.Setter;

/**
 * Credenciales de MongoDB entregadas por el gestor de secretos.
 */
@Getter
@Setter
public class SecretDto {
    private String uri;
    private String database;
}
