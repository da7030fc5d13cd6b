package io.github.themoah.feedist.http;

import io.github.themoah.feedist.distributor.DistributorException;
import io.github.themoah.feedist.distributor.ErrorKind;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import java.math.BigInteger;

/**
 * JSON response helpers shared by the HTTP handlers.
 */
final class HttpResponses {

  static final String CONTENT_TYPE_JSON = "application/json";
  static final String ACCOUNT_HEADER = "X-Account";

  private HttpResponses() {}

  static void ok(RoutingContext ctx, JsonObject body) {
    send(ctx, 200, body);
  }

  static void error(RoutingContext ctx, DistributorException e) {
    error(ctx, e, new JsonObject());
  }

  /**
   * Sends an error response carrying extra fields next to the error kind and message.
   */
  static void error(RoutingContext ctx, DistributorException e, JsonObject extra) {
    send(ctx, statusOf(e.kind()), extra
      .put("error", e.kind().getValue())
      .put("message", e.getMessage()));
  }

  static int statusOf(ErrorKind kind) {
    return switch (kind) {
      case PERMISSION_DENIED -> 403;
      case ORACLE_UNAVAILABLE -> 503;
      case TRANSFER_FAILED -> 502;
      case INVALID_ARGUMENT -> 400;
    };
  }

  /**
   * Returns the caller named in the account header, or throws if it is missing.
   */
  static String caller(RoutingContext ctx) {
    String caller = ctx.request().getHeader(ACCOUNT_HEADER);
    if (caller == null || caller.isBlank()) {
      throw DistributorException.invalidArgument("Missing " + ACCOUNT_HEADER + " header");
    }
    return caller.trim();
  }

  static JsonObject body(RoutingContext ctx) {
    JsonObject body;
    try {
      body = ctx.body().asJsonObject();
    } catch (RuntimeException e) {
      throw DistributorException.invalidArgument("Request body is not a JSON object");
    }
    if (body == null) {
      throw DistributorException.invalidArgument("Request body is required");
    }
    return body;
  }

  static String requiredString(JsonObject body, String field) {
    Object value = body.getValue(field);
    if (!(value instanceof String text) || text.isBlank()) {
      throw DistributorException.invalidArgument("Field '" + field + "' must be a non-blank string");
    }
    return text;
  }

  /**
   * Reads a token amount given either as a decimal string or a JSON number.
   */
  static BigInteger requiredAmount(JsonObject body, String field) {
    Object value = body.getValue(field);
    try {
      if (value instanceof String text) {
        return new BigInteger(text.trim());
      }
      if (value instanceof BigInteger big) {
        return big;
      }
      if (value instanceof Integer || value instanceof Long) {
        return BigInteger.valueOf(((Number) value).longValue());
      }
    } catch (NumberFormatException e) {
      throw DistributorException.invalidArgument("Field '" + field + "' is not an integer: " + value);
    }
    throw DistributorException.invalidArgument("Field '" + field + "' is required");
  }

  static long requiredLong(JsonObject body, String field) {
    Object value = body.getValue(field);
    try {
      if (value instanceof Number number) {
        return number.longValue();
      }
      if (value instanceof String text) {
        return Long.parseLong(text.trim());
      }
    } catch (NumberFormatException e) {
      throw DistributorException.invalidArgument("Field '" + field + "' is not an integer: " + value);
    }
    throw DistributorException.invalidArgument("Field '" + field + "' is required");
  }

  static long pathLong(RoutingContext ctx, String param) {
    String value = ctx.pathParam(param);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw DistributorException.invalidArgument("Path parameter '" + param + "' is not an integer: " + value);
    }
  }

  private static void send(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }
}
