/**
 * Command line entry points: the {@code qaops} dispatcher and its {@code analyze} and {@code kpi} commands.
 */
package ca.gc.cra.qaops.api;
