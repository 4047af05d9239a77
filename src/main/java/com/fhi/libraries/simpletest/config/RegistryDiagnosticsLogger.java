package com.fhi.libraries.simpletest.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fhi.libraries.simpletest.SimpleTest;
import com.fhi.libraries.simpletest.registry.TestRegistry;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;


/**
 * Logs the state of the {@link TestRegistry} during startup, to check that ignore lists, proxies
 * and preferred objects are configured as expected.
 *
 * <p>Enabled by setting:
 * <pre>
 *   simpletest.diagnostics.enabled=true
 * </pre>
 */
@Slf4j
@AutoConfiguration(after = SimpleTestConfiguration.class)
@ConditionalOnProperty(name = "simpletest.diagnostics.enabled", havingValue = "true", matchIfMissing = false)
public class RegistryDiagnosticsLogger
{
   private static final String PREFIX = "[SimpleTest Diagnostics]";

   private static final ObjectMapper DUMP_MAPPER = new ObjectMapper()
                                                       .enable(SerializationFeature.INDENT_OUTPUT);

   private final TestRegistry registry;

   public RegistryDiagnosticsLogger(TestRegistry registry)
   {  this.registry = registry;
   }


   @PostConstruct
   public void logDiagnostics()
   {
      log.info("{} Diagnostics mode is ON", PREFIX);
      log.info("{} Version  : {}", PREFIX, SimpleTest.getVersion());
      log.info("{} Registry :\n{}", PREFIX, describe());
   }

   /**
    * Pretty printed JSON view of the registry.
    */
   public String describe()
   {
      try
      {  return DUMP_MAPPER.writeValueAsString(registry.snapshot());
      }
      catch (JsonProcessingException e)
      {  log.warn("{} Could not serialize registry: {}", PREFIX, e.getMessage());
         return String.valueOf(registry.snapshot());
      }
   }
}
