/**
 * Read models for the aggregate counters maintained alongside the play history.
 */
package playlog.model;
