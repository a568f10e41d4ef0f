package com.infound.creatorportal.server.resource;

import com.infound.creatorportal.model.ApiResponse;
import jakarta.inject.Singleton;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Unauthenticated landing endpoint, {@code GET /}.
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class HomeResource {

  private final String serviceName;

  public HomeResource(String serviceName) {
    this.serviceName = serviceName;
  }

  @GET
  public ApiResponse<Map<String, String>> home() {
    return ApiResponse.success(Map.of("service", serviceName));
  }
}
