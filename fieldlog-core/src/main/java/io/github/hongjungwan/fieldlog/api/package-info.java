/**
 * Public API for fieldlog.
 *
 * <p>This package contains the types applications use directly: the logger interface,
 * the process-wide default logger and the logger configuration.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.FieldLogger} - Structured logging interface</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.FieldLog} - Global default logger</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.config.LogConfig} - Immutable logger configuration</li>
 *   <li>{@link io.github.hongjungwan.fieldlog.api.ErrorCounter} - Error occurrence counting</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * import io.github.hongjungwan.fieldlog.api.*;
 * import io.github.hongjungwan.fieldlog.api.config.LogConfig;
 *
 * public class OrderService {
 *
 *     public static void main(String[] args) {
 *         FieldLog.init(LogConfig.create()
 *                 .withConsoleJson()
 *                 .withLevel("debug")
 *                 .withToIgnore("health check")
 *                 .withSimpleErrorCounter(), "service", "orders");
 *
 *         FieldLogger logger = FieldLog.withFields("component", "checkout");
 *         logger.infof("order %s accepted", orderId, "amount", 1200);
 *         logger.error("payment failed", "order_id", orderId, "error", e); // error attached
 *
 *         FieldLog.shutdown();
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.fieldlog.api;
