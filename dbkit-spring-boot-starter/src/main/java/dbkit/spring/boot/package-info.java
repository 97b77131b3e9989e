/**
 * Spring Boot auto-configuration for dbkit.
 */
package dbkit.spring.boot;
