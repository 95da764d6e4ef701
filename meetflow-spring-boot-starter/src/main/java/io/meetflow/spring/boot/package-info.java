/**
 * Spring Boot auto-configuration for the meetflow pipeline.
 *
 * <p>Add {@code meetflow-spring-boot-starter} next to a {@link javax.sql.DataSource} and
 * provide a {@link io.meetflow.spi.TranscriptSource} and a
 * {@link io.meetflow.spi.DraftGenerationTrigger} bean; everything else is wired from
 * {@code meetflow.*} properties.
 *
 * @see io.meetflow.spring.boot.MeetflowAutoConfiguration
 * @see io.meetflow.spring.boot.MeetflowProperties
 */
package io.meetflow.spring.boot;
