/**
 * Calendar and clock predicates used by ignore rules and analysis windows.
 * <p>Wall-clock values ({@link java.time.LocalDateTime}, {@link java.time.LocalTime}) are interpreted in the
 * analyzer's reference zone by callers; absolute values are always {@link java.time.Instant}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.qaops.domain.time;
