package NFAMin.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * HTTP front end: POST a JSON NFA to /minimize, get the minimal DFA back.
 */
public class ConversionServer {
    public static final String PATH = "/minimize";

    private static final int METHOD_NOT_ALLOWED = 405;

    private final HttpServer server;
    private final ConversionService service;

    public ConversionServer(int port, ConversionService service) throws IOException {
        this.service = service;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(PATH, this::handle);
    }

    public void start() {
        server.start();
        System.out.println("Listening on port " + getPort() + ", POST NFAs to " + PATH);
    }

    public void stop() {
        server.stop(0);
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            ConversionService.Response response;
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().add("Allow", "POST");
                response = new ConversionService.Response(METHOD_NOT_ALLOWED,
                    "{\"error\":\"MethodNotAllowed\"}");
            } else {
                String body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
                response = service.handle(body);
            }
            byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(response.status(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }
}
