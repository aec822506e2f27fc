/**
 * The run loop, its jobs, and the hooks an action sees while it runs.
 */
package com.questrail.cronner.dispatch;
