package net.storefleet.core.pipeline;

/**
 * 파이프라인의 이름 있는 단계. 각 단계는 개별적으로 멱등이어야 한다.
 * execute 실패 분류는 kind 로 결정되고, 보상(compensate)은 롤백 워크에서 역순으로 호출된다.
 */
public interface PipelineStep {
    enum Kind { CRITICAL, BEST_EFFORT }

    String name();

    default Kind kind() { return Kind.CRITICAL; }

    /** false 면 실패해도 롤백 워크 없이 테넌트만 FAILED 처리 */
    default boolean rollbackEligible() { return true; }

    void execute(PipelineContext ctx) throws Exception;

    /** 부분 적용 상태에서도 안전해야 한다 */
    default void compensate(PipelineContext ctx) throws Exception { }
}
