package kr.jemi.zcloset.viewer.application.port.in;

public interface TrackViewerUseCase {

    void addViewer(String productId, String viewerId);

    void removeViewer(String productId, String viewerId);
}
