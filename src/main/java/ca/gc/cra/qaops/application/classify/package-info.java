/**
 * Alarm type construction, analysis window selection and on-call business hours classification.
 */
package ca.gc.cra.qaops.application.classify;
