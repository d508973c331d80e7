package io.github.drompincen.aigov.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private ToolRegistry registry;
    private ApplicationContext mockContext;

    @BeforeEach
    void setUp() {
        mockContext = mock(ApplicationContext.class);
        when(mockContext.getBean(any(Class.class))).thenThrow(new NoSuchBeanDefinitionException("none"));
        registry = new ToolRegistry(mockContext);
    }

    private static Tool named(String name) {
        return new Tool() {
            @Override public String name() { return name; }
            @Override public String description() { return name + " description"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                return ToolResult.success(new TextNode(name));
            }
        };
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(named("search_decisions"));

        assertThat(registry.get("search_decisions")).isPresent();
        assertThat(registry.get("search_decisions").get().name()).isEqualTo("search_decisions");
        assertThat(registry.get("nonexistent")).isEmpty();
    }

    @Test
    void allReturnsRegisteredTools() {
        assertThat(registry.all()).isEmpty();

        registry.register(named("get_decision"));

        assertThat(registry.all()).hasSize(1);
    }

    @Test
    void specsAreSortedByName() {
        registry.register(named("wiki_search"));
        registry.register(named("get_decision"));

        var specs = registry.specs();
        assertThat(specs).extracting(s -> s.name()).containsExactly("get_decision", "wiki_search");
        assertThat(specs.get(0).description()).isEqualTo("get_decision description");
    }

    @Test
    void injectDependenciesWiresSetterWhenBeanAvailable() throws Exception {
        Object injectedValue = new Object();
        ToolWithSetter tool = new ToolWithSetter();
        doReturn(injectedValue).when(mockContext).getBean(Object.class);

        var method = ToolRegistry.class.getDeclaredMethod("injectDependencies", Tool.class);
        method.setAccessible(true);
        method.invoke(registry, tool);

        assertThat(tool.injectedObject).isSameAs(injectedValue);
    }

    @Test
    void injectDependenciesSkipsWhenNoBeanAvailable() throws Exception {
        ToolWithSetter tool = new ToolWithSetter();

        var method = ToolRegistry.class.getDeclaredMethod("injectDependencies", Tool.class);
        method.setAccessible(true);
        method.invoke(registry, tool);

        assertThat(tool.injectedObject).isNull();
    }

    static class ToolWithSetter implements Tool {
        Object injectedObject;

        public void setInjectedObject(Object obj) { this.injectedObject = obj; }

        @Override public String name() { return "setter_tool"; }
        @Override public String description() { return "test"; }
        @Override public JsonNode inputSchema() { return null; }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return null; }
    }
}
