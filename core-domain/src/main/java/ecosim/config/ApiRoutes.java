package ecosim.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Prefijo base
    public static final String API = "/api";

    // Rutas REST
    public static final String SIMULATION = API + "/simulation";
    public static final String SCENARIOS = API + "/scenarios";
    public static final String HEALTH = API + "/health";

    // Rutas STOMP
    public static final String WS_ENDPOINT = "/ws";
    public static final String TOPIC_PREFIX = "/topic";
    public static final String APP_PREFIX = "/app";
    public static final String TOPIC_SIMULATION = TOPIC_PREFIX + "/simulation";
}
