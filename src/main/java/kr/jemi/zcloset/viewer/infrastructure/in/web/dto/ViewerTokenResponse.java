package kr.jemi.zcloset.viewer.infrastructure.in.web.dto;

public record ViewerTokenResponse(String viewerId) {
}
