/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application; presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers are thin adapters - business logic lives in services</li>
 *   <li>Exception handlers map domain exceptions to HTTP status codes</li>
 * </ul>
 */
package com.phillippitts.sessionrecorder.presentation;
