package com.autosem.digital.process.optimizer.domain.port.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Servicio para notificar a administradores sobre eventos críticos del optimizador
 * (pausa de emergencia, fallos de una pasada completa).
 *
 * Nota: esta implementación registra las notificaciones en logs. El envío real
 * por correo, SMS o Slack queda fuera de este servicio.
 */
@Service
@Slf4j
public class AdminNotificationService {

    @Value("${notification.admin.enabled:false}")
    private boolean notificationsEnabled;

    @Value("${notification.admin.recipients:admin@example.com}")
    private String[] adminRecipients;

    /**
     * Notifica a los administradores sobre un error crítico
     * @param subject Asunto de la notificación
     * @param message Mensaje detallado
     */
    public void notifyCriticalError(String subject, String message) {
        if (!notificationsEnabled) {
            log.info("Notificaciones deshabilitadas. No se enviará notificación para: {}", subject);
            return;
        }

        log.info("Enviando notificación crítica a administradores");
        log.info("Asunto: {}", subject);
        log.info("Mensaje: {}", message);
        log.info("Destinatarios: {}", String.join(", ", adminRecipients));
    }

    /**
     * Notifica la pausa de emergencia de todas las campañas activas
     * @param netLoss Pérdida neta acumulada que disparó la pausa
     * @param threshold Umbral configurado
     * @param pausedCount Campañas pausadas
     */
    public void notifyEmergencyPause(double netLoss, double threshold, int pausedCount) {
        String subject = "Pausa de emergencia: pérdida neta de $" + String.format(Locale.ROOT, "%.2f", netLoss);

        StringBuilder message = new StringBuilder();
        message.append("Se pausaron todas las campañas activas:\n\n");
        message.append("- Pérdida neta: ").append(String.format(Locale.ROOT, "%.2f", netLoss)).append("\n");
        message.append("- Umbral: ").append(String.format(Locale.ROOT, "%.2f", threshold)).append("\n");
        message.append("- Campañas pausadas: ").append(pausedCount).append("\n");
        message.append("\nRevise la configuración y el rendimiento antes de reactivar campañas.");

        notifyCriticalError(subject, message.toString());
    }
}
