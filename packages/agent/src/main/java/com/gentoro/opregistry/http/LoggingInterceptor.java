package com.gentoro.opregistry.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.opregistry.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("➡️ {} {}\nHeaders:\n{}", request.method(), request.url(), request.headers());

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code(),
        response.headers());

    if (log.isTraceEnabled()) {
      // peek so the caller can still consume the body
      ResponseBody responseBody = response.peekBody(Long.MAX_VALUE);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }
}
