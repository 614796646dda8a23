package dev;

import com.habrok.core.Habrok;
import com.habrok.core.http.HttpStatusException;
import com.habrok.core.model.ClientConfig;
import com.habrok.core.model.Request;
import com.habrok.core.model.ResponseData;
import com.habrok.core.util.LoggingConfigurator;
import com.habrok.core.util.YamlConfigLoader;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * SmokeTarget을 임의 포트로 띄우고 엔드포인트마다 Habrok 호출 결과를 로그로 남긴다.
 * 작업 디렉터리에 habrok.yml이 있으면 그 설정을 쓴다.
 */
public class SmokeClient {

  private static final Logger LOG = LoggerFactory.getLogger(SmokeClient.class);

  public static void main(String[] args) throws Exception {
    LoggingConfigurator.init(LoggingConfigurator.levelFromSystem());

    ClientConfig cfg = Files.exists(Path.of("habrok.yml"))
        ? YamlConfigLoader.loadDefault()
        : ClientConfig.defaults();
    LOG.info("config: {}", cfg);

    HttpServer server = SmokeTarget.start(0);
    String base = "http://127.0.0.1:" + server.getAddress().getPort();
    try {
      Habrok habrok = new Habrok(cfg);
      for (String path : List.of("/ok", "/text", "/flaky", "/limited", "/boom")) {
        call(habrok, base + path);
      }
      call(new Habrok(cfg.copy().setDisableAutomaticJson(true)), base + "/text");
    } finally {
      server.stop(0);
    }
  }

  static void call(Habrok habrok, String uri) throws InterruptedException {
    long start = System.nanoTime();
    try {
      ResponseData out = habrok.send(Request.get(uri));
      LOG.info("{} -> {} {} ({}ms)", uri, out.getStatusCode(), out.getBody(), elapsedMs(start));
    } catch (HttpStatusException e) {
      LOG.warn("{} -> HTTP {} {} data={} ({}ms)",
          uri, e.getStatusCode(), e.getMessage(), e.getData(), elapsedMs(start));
    } catch (IOException e) {
      LOG.error("{} -> transport error ({}ms)", uri, elapsedMs(start), e);
    }
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
