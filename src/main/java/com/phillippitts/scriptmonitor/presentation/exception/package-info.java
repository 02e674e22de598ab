/**
 * Maps exceptions raised behind the REST API to {@code ApiError} responses.
 */
package com.phillippitts.scriptmonitor.presentation.exception;
