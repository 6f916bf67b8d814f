package com.boxline.billing.infrastructure.support;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * OkHttp interceptor that answers from a queue of canned responses and records every request.
 */
public final class CannedHttp implements Interceptor {

  private static final MediaType JSON = MediaType.parse("application/json");

  public record Recorded(String method, String path, String authorization, String body) {
  }

  private record Canned(int code, String body, IOException failure) {
  }

  private final Deque<Canned> queue = new ArrayDeque<>();
  private final List<Recorded> requests = new ArrayList<>();

  public CannedHttp respond(int code, String body) {
    queue.add(new Canned(code, body, null));
    return this;
  }

  public CannedHttp fail(IOException e) {
    queue.add(new Canned(0, null, e));
    return this;
  }

  public OkHttpClient client() {
    return new OkHttpClient.Builder().addInterceptor(this).build();
  }

  public List<Recorded> requests() {
    return requests;
  }

  public Recorded last() {
    return requests.get(requests.size() - 1);
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request req = chain.request();
    String body = null;
    if (req.body() != null) {
      Buffer buf = new Buffer();
      req.body().writeTo(buf);
      body = buf.readUtf8();
    }
    requests.add(new Recorded(req.method(), req.url().encodedPath(), req.header("Authorization"), body));

    Canned next = queue.poll();
    if (next == null) throw new IllegalStateException("no canned response for " + req.method() + " " + req.url());
    if (next.failure() != null) throw next.failure();
    return new Response.Builder()
        .request(req)
        .protocol(Protocol.HTTP_1_1)
        .code(next.code())
        .message("canned")
        .body(ResponseBody.create(next.body() == null ? "" : next.body(), JSON))
        .build();
  }
}
