package org.arpha.routing.definition;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RouteDefinition {

    private String name;
    private String origin;
    private String path;
    private String action;
    private Map<Integer, Object> params;
    private Map<String, Object> options;

}
