package kr.jemi.zcloset.viewer.infrastructure.in.web.dto;

public record ViewerCountResponse(String productId, int count) {
}
