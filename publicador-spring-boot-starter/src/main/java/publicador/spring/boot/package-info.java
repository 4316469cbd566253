/**
 * Spring Boot auto-configuration: {@code publicador.*} properties, engine, scheduler and
 * optional Micrometer metrics.
 */
package publicador.spring.boot;
