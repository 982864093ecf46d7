package com.ids.keycloak.gate.web.view;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NoRoleView(String email) {
}
