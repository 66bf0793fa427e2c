package com.autosem.digital.process.optimizer.infrastructure.outbound.adapter;

import com.autosem.digital.process.optimizer.domain.exception.PlatformCallException;
import com.autosem.digital.process.optimizer.domain.model.Platform;
import com.autosem.digital.process.optimizer.domain.port.service.AdPlatformClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clientes de plataforma publicitaria indexados por {@link Platform}.
 */
@Component
@Slf4j
public class AdPlatformRegistry {

    private final Map<Platform, AdPlatformClient> clients = new EnumMap<>(Platform.class);

    public AdPlatformRegistry(List<AdPlatformClient> clients) {
        for (AdPlatformClient client : clients) {
            AdPlatformClient previous = this.clients.put(client.platform(), client);
            if (previous != null) {
                throw new IllegalStateException("Cliente duplicado para la plataforma " + client.platform());
            }
            log.info("Cliente de plataforma registrado: {} (configurado: {})",
                    client.platform(), client.isConfigured());
        }
    }

    public Optional<AdPlatformClient> find(Platform platform) {
        return Optional.ofNullable(platform).map(clients::get);
    }

    public AdPlatformClient get(Platform platform) {
        return find(platform).orElseThrow(() ->
                new PlatformCallException(platform, "No hay cliente registrado para la plataforma " + platform));
    }
}
