/**
 * Alert state transitions and the notification edges they produce.
 */
package com.alertsentinel.core.state;
