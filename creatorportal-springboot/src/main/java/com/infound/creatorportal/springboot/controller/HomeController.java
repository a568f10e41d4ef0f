package com.infound.creatorportal.springboot.controller;

import com.infound.creatorportal.model.ApiResponse;
import com.infound.creatorportal.springboot.config.CreatorPortalProperties;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {

  private final String serviceName;

  public HomeController(CreatorPortalProperties props) {
    this.serviceName = props.getServiceName();
  }

  @GetMapping("/")
  public ApiResponse<Map<String, String>> home() {
    return ApiResponse.success(Map.of("service", serviceName));
  }
}
