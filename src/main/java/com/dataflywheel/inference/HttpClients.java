package com.dataflywheel.inference;

import java.io.IOException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

public final class HttpClients {
    private static final Logger log = LoggerFactory.getLogger(HttpClients.class);

    private HttpClients() {
    }

    public static OkHttpClient create(Duration callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .callTimeout(callTimeout)
                .readTimeout(callTimeout)
                .addInterceptor(new CallLoggingInterceptor())
                .build();
    }

    static final class CallLoggingInterceptor implements Interceptor {
        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long start = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                log.debug("http.call method={} url={} status={} durationMs={}",
                        request.method(), request.url(), response.code(), (System.nanoTime() - start) / 1_000_000);
                return response;
            } catch (IOException e) {
                log.warn("http.call.failed method={} url={} durationMs={} reason={}",
                        request.method(), request.url(), (System.nanoTime() - start) / 1_000_000, e.toString());
                throw e;
            }
        }
    }
}
