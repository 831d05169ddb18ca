/**
 * Translates failures at the REST boundary into HTTP error responses.
 */
package com.phillippitts.voicechat.presentation.exception;
