package com.autosem.digital.process.optimizer.domain.port.service;

import com.autosem.digital.process.optimizer.domain.DTO.OptimizationResult;
import com.autosem.digital.process.optimizer.domain.DTO.OptimizationSummary;
import reactor.core.publisher.Mono;

/**
 * Optimización de campañas activas.<br/>
 * <b>Class</b>: CampaignOptimizerService<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * <u>Developed by</u>: <br/>
 * <ul>
 * <li>Equipo de Optimización</li>
 * </ul>
 * <u>Base interface</u>:<br/>
 * <ul>
 * <li>Mar 10, 2025 CampaignOptimizerService Interface.</li>
 * </ul>
 * @version 1.0
 */
public interface CampaignOptimizerService {

    /**
     * Ejecuta una pasada completa: reglas por campaña, límites globales y persistencia.
     * Falla sólo si no se pueden cargar la configuración o las campañas activas.
     */
    Mono<OptimizationResult> optimizeAll();

    Mono<OptimizationSummary> getSummary();
}
