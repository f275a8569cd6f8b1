/**
 * Spring Boot auto-configuration for playlog, bound to {@code playlog.*} properties.
 */
package playlog.spring.boot;
