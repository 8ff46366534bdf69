/**
 * Engine exceptions, each classified by an
 * {@link com.alertsentinel.core.error.ErrorKind}.
 */
package com.alertsentinel.core.error;
