/**
 * Notification dispatch and the {@link com.alertsentinel.core.notify.Notifier}
 * delivery port.
 */
package com.alertsentinel.core.notify;
