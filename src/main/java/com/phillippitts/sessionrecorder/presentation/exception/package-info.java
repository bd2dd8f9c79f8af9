/**
 * Global exception handling for HTTP responses.
 */
package com.phillippitts.sessionrecorder.presentation.exception;
