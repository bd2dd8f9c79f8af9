/**
 * REST controllers for the recorder API.
 */
package com.phillippitts.sessionrecorder.presentation.controller;
