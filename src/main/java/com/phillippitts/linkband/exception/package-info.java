/**
 * Supervisor exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.linkband.exception.LinkBandException} - Base exception
 *       for all supervisor errors</li>
 *   <li>{@link com.phillippitts.linkband.exception.TransportException} - Socket closed, errored,
 *       or written while dead; triggers the reconnect policy</li>
 *   <li>{@link com.phillippitts.linkband.exception.HealthTimeoutException} - Liveness probes
 *       went unanswered; handled as a transport failure</li>
 *   <li>{@link com.phillippitts.linkband.exception.ProtocolException} - Inbound frame could not be
 *       decoded; the frame is dropped and the link kept</li>
 *   <li>{@link com.phillippitts.linkband.exception.SupervisorConfigurationException} - Invalid
 *       thresholds or intervals detected at startup</li>
 * </ul>
 *
 * <p>None of these reach the UI as raw errors. Users only see the aggregated overall status and
 * the recording gate's reason string; the HTTP boundary maps any that escape to
 * {@code ApiError} bodies via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.linkband.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.linkband.exception;
