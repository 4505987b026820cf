/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.linkband.presentation.controller.SupervisorStatusController}
 *       - Bridge status, recording gate, debug info, alerts and history under {@code /supervisor},
 *       plus manual connect/disconnect, streaming requests and required sensors</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over {@code BridgeSupervisor}; exceptions are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.linkband.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.linkband.presentation.controller;
