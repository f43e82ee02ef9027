package com.gentoro.opregistry.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/**
 * Builds the client used for manifest fetches. Per-call timeouts are applied by {@link
 * OkHttpManifestClient}; the limits here only bound a single connect or read.
 */
public class OkHttpFactory {
  public static final String USER_AGENT = "operation-registry-agent";

  public static OkHttpClient create() {
    return create(USER_AGENT);
  }

  public static OkHttpClient create(String userAgent) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(20, TimeUnit.SECONDS)
        // manifests live at a fixed location, a redirect means a misconfigured base URL
        .followRedirects(false)
        .addInterceptor(
            chain ->
                chain.proceed(
                    chain.request().newBuilder().header("User-Agent", userAgent).build()))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
