package ca.gc.cra.logship.config;

/**
 * Flattened configuration keys shared by the YAML, environment, and CLI sources.
 *
 * @since 0.1.0
 */
public final class ConfigKeys {
  public static final String TAG = "tag";
  public static final String SHUTDOWN_TIMEOUT = "shutdownTimeout";
  public static final String LOG_LEVEL = "logLevel";
  public static final String DURATION_ENCODING = "durationEncoding";

  public static final String NETWORK = "transport.network";
  public static final String HOST = "transport.host";
  public static final String PORT = "transport.port";
  public static final String SOCKET_PATH = "transport.socketPath";
  public static final String TIMEOUT = "transport.timeout";
  public static final String WRITE_TIMEOUT = "transport.writeTimeout";
  public static final String BUFFER_LIMIT = "transport.bufferLimit";
  public static final String MAX_RETRY = "transport.maxRetry";
  public static final String RETRY_WAIT = "transport.retryWait";
  public static final String ASYNC = "transport.async";
  public static final String FORCE_STOP_ASYNC_SEND = "transport.forceStopAsyncSend";
  public static final String SUB_SECOND_PRECISION = "transport.subSecondPrecision";
  public static final String MARSHAL_AS_JSON = "transport.marshalAsJson";
  public static final String REQUEST_ACK = "transport.requestAck";
  public static final String TLS_INSECURE_SKIP_VERIFY = "transport.tlsInsecureSkipVerify";
  public static final String ASYNC_RECONNECT_INTERVAL = "transport.asyncReconnectInterval";
  public static final String TAG_PREFIX = "transport.tagPrefix";

  private ConfigKeys() {}
}
