/**
 * Raw chat events as delivered by an event source, before any alarm extraction.
 *
 * <p>Events carry an optional plain text body, Slack-style attachments and uploaded files, plus an
 * epoch-seconds timestamp string.</p>
 */
package ca.gc.cra.qaops.domain.event;
