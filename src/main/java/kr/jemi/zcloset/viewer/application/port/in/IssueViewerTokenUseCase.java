package kr.jemi.zcloset.viewer.application.port.in;

public interface IssueViewerTokenUseCase {

    /**
     * 로그인하지 않은 방문자를 구분하기 위한 익명 세션 토큰을 발급한다.
     */
    String issueViewerToken();
}
