/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.linkband.exception.TransportException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.linkband.exception.SupervisorConfigurationException} → 503 Service Unavailable</li>
 *   <li>{@link IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.linkband.exception.LinkBandException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "TransportException",
 *   "message": "Bridge connection unavailable",
 *   "details": "Please retry once the bridge is connected",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.linkband.exception
 * @since 1.0
 */
package com.phillippitts.linkband.presentation.exception;
