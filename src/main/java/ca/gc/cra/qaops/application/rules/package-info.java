/**
 * Declarative ignore rules and the engine that evaluates them against raw events.
 */
package ca.gc.cra.qaops.application.rules;
