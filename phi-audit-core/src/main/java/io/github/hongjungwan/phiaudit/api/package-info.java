/**
 * Public API for the PHI Audit SDK.
 *
 * <p>This package contains the interfaces and classes that applications
 * interact with directly: the structured logger, correlation context
 * propagation and SDK configuration.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.phiaudit.api.ComplianceLogger} - Structured logging with PHI masking</li>
 *   <li>{@link io.github.hongjungwan.phiaudit.api.context.CorrelationContext} - Correlation ID propagation</li>
 *   <li>{@link io.github.hongjungwan.phiaudit.api.config.ComplianceLogConfig} - SDK configuration</li>
 *   <li>{@code io.github.hongjungwan.phiaudit.core.audit.AuditTrail} - Tamper-evident audit trail</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * public class PatientService {
 *     private static final ComplianceLogger logger = ComplianceLogger.getLogger(PatientService.class);
 *
 *     public void admit(String patientId, String email) {
 *         try (var scope = CorrelationContext.bind(CorrelationContext.newCorrelationId())) {
 *             logger.info("Admitting patient", Map.of(
 *                 "patientId", patientId,
 *                 "contact", email  // Auto-masked
 *             ));
 *         }
 *     }
 * }
 * }</pre>
 */
package io.github.hongjungwan.phiaudit.api;
