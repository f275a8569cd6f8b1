/** Retention purge of old history rows. */
package playlog.jdbc.purge;
