package com.agentflow.worker.invoker;

import com.agentflow.core.exception.WorkerInvocationException;
import com.agentflow.core.model.WorkerDescriptor;
import com.agentflow.worker.WorkerContext;
import com.agentflow.worker.WorkerResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompositeWorkerInvokerTest {

    @Mock
    private WorkerInvoker local;

    @Mock
    private WorkerInvoker remote;

    private final WorkerDescriptor descriptor = WorkerDescriptor.builder().id("debugger").build();

    @Test
    void invoke_shouldUseFirstSupportingDelegate() throws Exception {
        WorkerContext context = mock(WorkerContext.class);
        WorkerResult expected = WorkerResult.success().build();
        when(local.supports(descriptor)).thenReturn(true);
        when(local.invoke(descriptor, context)).thenReturn(expected);

        CompositeWorkerInvoker composite = new CompositeWorkerInvoker(List.of(local, remote));

        assertThat(composite.invoke(descriptor, context)).isSameAs(expected);
        verify(remote, never()).invoke(any(), any());
    }

    @Test
    void invoke_shouldFallThroughToLaterDelegate() throws Exception {
        WorkerContext context = mock(WorkerContext.class);
        WorkerResult expected = WorkerResult.needsFollowUp().build();
        when(local.supports(descriptor)).thenReturn(false);
        when(remote.supports(descriptor)).thenReturn(true);
        when(remote.invoke(descriptor, context)).thenReturn(expected);

        CompositeWorkerInvoker composite = new CompositeWorkerInvoker(List.of(local, remote));

        assertThat(composite.invoke(descriptor, context)).isSameAs(expected);
    }

    @Test
    void invoke_shouldFailWhenNoDelegateSupportsWorker() {
        CompositeWorkerInvoker composite = new CompositeWorkerInvoker(List.of(local, remote));

        assertThat(composite.supports(descriptor)).isFalse();
        assertThatThrownBy(() -> composite.invoke(descriptor, mock(WorkerContext.class)))
            .isInstanceOf(WorkerInvocationException.class);
    }
}
