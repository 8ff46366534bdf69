/**
 * Storage port and its in-memory implementation.
 */
package com.alertsentinel.core.store;
