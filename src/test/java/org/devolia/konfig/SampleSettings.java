package org.devolia.konfig;

import static org.devolia.konfig.EnvVariable.env;
import static org.devolia.konfig.LazyVariable.lazy;
import static org.devolia.konfig.SecretVariable.vault;

import java.util.Map;

/** Settings class used by tests that load settings by class or class name. */
public class SampleSettings {

  public static final boolean DEBUG = false;
  public static final EnvVariable PORT = env("PORT", 8000).withCast(Casts::toInteger);
  public static final String VAULT_ADDR = "http://vault.local:8200";
  public static final EnvVariable VAULT_TOKEN = env("VAULT_TOKEN");
  public static final SecretVariable SECRET = vault("path/to").key("SECRET");
  public static final SecretVariable NESTED_SECRET = vault("path/to").key("nested").key("key");
  public static final LazyVariable URL = lazy(c -> "http://localhost:" + c.get("PORT"));
  public static final Map<String, Object> DATABASE = Map.of("HOST", "db", "PORT", 5432);

  public static final String lowercase = "not an option";

  public String instanceField = "ignored for classes";
}
