package tech.yump.rotator.template;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateValidatorTest {

    private final TemplateValidator validator = TemplateFixtures.validator();

    @Test
    @DisplayName("validate: Bundled templates should have no problems")
    void bundledTemplatesAreValid() {
        for (ProviderTemplate template : TemplateFixtures.bundledRegistry().all()) {
            assertThat(validator.validate(template)).as(template.name()).isEmpty();
        }
    }

    @Test
    @DisplayName("validate: Should require a set operation")
    void setIsMandatory() {
        ProviderTemplate template = TemplateFixtures.parse("""
                {"name": "no-set", "functions": {"test": {"type": "HTTP", "method": "GET", "url": "https://example.com"}}}
                """);

        assertThat(validator.validate(template)).contains("functions: 'set' is mandatory");
    }

    @Test
    @DisplayName("validate: Should report shape violations from bean validation")
    void beanValidation() {
        ProviderTemplate template = TemplateFixtures.parse("""
                {"name": "Bad Name",
                 "internal": {"secret": {"type": "string"}},
                 "functions": {"set": {"type": "HTTP", "method": "POST", "url": "https://example.com",
                   "pre": {"internal.secret": {"type": "random", "length": 0}}}}}
                """);

        List<String> problems = validator.validate(template);

        assertThat(problems).anySatisfy(problem -> assertThat(problem).startsWith("name:"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("length must be at least 1"));
    }

    @Test
    @DisplayName("validate: Should check identity fields, pre targets, setter targets and candidates")
    void semanticReferences() {
        ProviderTemplate template = TemplateFixtures.parse("""
                {"name": "refs",
                 "inputs": {"user1": {"type": "string"}},
                 "outputs": {"key": {"type": "string"}},
                 "internal": {"user": {"type": "string"}},
                 "identity": ["host"],
                 "functions": {"set": {"type": "HTTP", "method": "POST", "url": "https://example.com",
                   "pre": {
                     "outputs.key": {"type": "value", "value": "x"},
                     "internal.user": {"type": "alternate", "candidates": ["inputs.user1", "inputs.user2"]}
                   },
                   "setter": {
                     "inputs.user1": {"path": "user"},
                     "internal.unknown": {"path": "id"}
                   }}}}
                """);

        List<String> problems = validator.validate(template);

        assertThat(problems).containsExactlyInAnyOrder(
                "identity: 'host' is not a declared input",
                "functions.set.pre: 'outputs.key' must target the internal namespace",
                "functions.set.pre.internal.user: candidate 'inputs.user2' is not a declared field",
                "functions.set.setter: 'inputs.user1' cannot write inputs",
                "functions.set.setter: 'internal.unknown' is not a declared internal field");
    }

    @Test
    @DisplayName("validate: Should reject tokens naming undeclared fields or malformed expressions")
    void tokenReferences() {
        ProviderTemplate template = TemplateFixtures.parse("""
                {"name": "tokens",
                 "inputs": {"host": {"type": "string"}},
                 "functions": {
                   "set": {"type": "HTTP", "method": "POST", "url": "https://${inputs.hostname}/keys",
                     "body": {"scopes": {"ref": "inputs.scopes"}}},
                   "remove": {"type": "DB", "client": "postgres", "host": "${inputs.host}", "port": "5432",
                     "database": "app", "username": "admin", "password": "${secrets.pw}", "query": "SELECT 1"}
                 }}
                """);

        List<String> problems = validator.validate(template);

        assertThat(problems).hasSize(3);
        assertThat(problems).anySatisfy(problem -> assertThat(problem).contains("undeclared field 'inputs.hostname'"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).startsWith("functions.set.body").contains("inputs.scopes"));
        assertThat(problems).anySatisfy(problem -> assertThat(problem).startsWith("functions.remove").contains("unknown scope"));
    }
}
