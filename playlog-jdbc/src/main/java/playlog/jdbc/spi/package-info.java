/** Dialect SPI. */
package playlog.jdbc.spi;
