package fr.lapetina.kvrouter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.RoutingResponse;

/**
 * Body returned by {@code POST /v1/route}. {@code decided=false} tells the caller to keep its
 * own primary choice.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResponse {

    @JsonProperty("request_id")
    private String requestId;

    private String model;
    private boolean decided;
    private Server server;
    private String picker;

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public boolean isDecided() { return decided; }
    public void setDecided(boolean decided) { this.decided = decided; }

    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }

    public String getPicker() { return picker; }
    public void setPicker(String picker) { this.picker = picker; }

    public static RouteResponse fromRoutingResponse(RoutingResponse response) {
        RouteResponse dto = new RouteResponse();
        dto.setRequestId(response.requestId());
        dto.setModel(response.model());
        dto.setDecided(response.isDecided());
        dto.setPicker(response.picker());
        response.selected().ifPresent(server -> dto.setServer(Server.from(server)));
        return dto;
    }

    public static class Server {
        private String name;
        private String url;
        private String address;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        static Server from(CandidateServer candidate) {
            Server server = new Server();
            server.setName(candidate.getName());
            server.setUrl(candidate.getEndpoint());
            server.setAddress(candidate.getAddress());
            return server;
        }
    }
}
