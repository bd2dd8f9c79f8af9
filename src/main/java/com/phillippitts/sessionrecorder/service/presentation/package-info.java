/**
 * Presentation surface contract and the headless implementation backing the REST status view.
 */
package com.phillippitts.sessionrecorder.service.presentation;
