/**
 * In-memory buffering of play events between producers and the flush scheduler.
 */
package playlog.buffer;
