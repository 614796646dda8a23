package dev;

import com.sun.net.httpserver.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재시도 동작 확인용 로컬 HTTP 서버.
 *  /ok      JSON 200
 *  /text    XML 텍스트 200
 *  /limited 항상 429
 *  /flaky   429 두 번 후 200 (3회 주기로 반복)
 *  /boom    500
 */
public class SmokeTarget {

  private static final Logger LOG = LoggerFactory.getLogger(SmokeTarget.class);

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int port = (args.length > 0) ? Integer.parseInt(args[0]) : 8080;
    HttpServer http = start(port);
    LOG.info("HTTP server on http://localhost:{}", http.getAddress().getPort());
  }

  /** port=0이면 임의 포트 */
  public static HttpServer start(int port) throws IOException {
    HttpServer http = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
    wireEndpoints(http);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    return http;
  }

  // 공통 엔드포인트 배선
  static void wireEndpoints(HttpServer s) {
    add(s, "/ok", ex -> {
      String ua = ex.getRequestHeaders().getFirst("User-Agent");
      resp(ex, 200, "application/json", "{\"status\":\"ok\",\"userAgent\":\"" + ua + "\"}");
    });

    add(s, "/text", ex -> resp(ex, 200, "application/xml", "<ship name=\"habrok\"/>"));

    add(s, "/limited", ex -> resp(ex, 429, "application/json", "{\"error\":\"slow down\"}"));

    AtomicInteger flaky = new AtomicInteger();
    add(s, "/flaky", ex -> {
      int n = flaky.incrementAndGet();
      if (n % 3 != 0) resp(ex, 429, "application/json", "{\"error\":\"busy\",\"hit\":" + n + "}");
      else resp(ex, 200, "application/json", "{\"status\":\"recovered\",\"hit\":" + n + "}");
    });

    add(s, "/boom", ex -> resp(ex, 500, "application/json", "{\"error\":\"exploded\"}"));
  }

  // ===== 공통 유틸 =====
  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
