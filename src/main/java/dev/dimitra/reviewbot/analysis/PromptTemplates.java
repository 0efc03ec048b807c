package dev.dimitra.reviewbot.analysis;

import dev.dimitra.reviewbot.model.ReviewCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One prompt template per review category. Every category has an entry.
 */
public final class PromptTemplates {

    private static final Map<ReviewCategory, PromptTemplate> TEMPLATES = new EnumMap<>(ReviewCategory.class);

    static {
        register(new PromptTemplate(ReviewCategory.SECURITY,
                "a cybersecurity expert conducting a thorough security code review",
                "security vulnerability",
                List.of("Input validation and sanitization of user input",
                        "Authentication and authorization checks",
                        "Data protection and sensitive data exposure",
                        "Injection attacks (SQL, XSS, command injection)",
                        "Error handling that discloses information",
                        "Cryptography and insecure randomness",
                        "Session management",
                        "OWASP Top 10 risks"),
                "- State the vulnerability type and impact level (Critical/High/Medium/Low)\n- Give specific remediation steps",
                "Line 15: Issue: SQL Injection vulnerability (Critical) - user input is concatenated into the query string"));
        register(new PromptTemplate(ReviewCategory.PERFORMANCE,
                "a performance optimization expert",
                "performance issue",
                List.of("Algorithm complexity", "Data structure choice", "Memory management and leaks",
                        "Database operations and N+1 queries", "Caching opportunities", "I/O and network calls",
                        "Concurrency and blocking calls", "Scalability under load"),
                "- Identify the bottleneck and its impact (High/Medium/Low)\n- Give specific optimization suggestions",
                "Line 25: Issue: Inefficient loop (Medium) - O(n^2) complexity due to nested iteration"));
        register(new PromptTemplate(ReviewCategory.CODING_PRACTICES,
                "a senior software engineer expert in coding standards and best practices",
                "best practice violation",
                List.of("Code structure and separation of concerns", "Naming conventions",
                        "Function design and length", "Error handling and propagation", "Documentation",
                        "Code duplication", "SOLID principles", "Design pattern usage", "Maintainability"),
                "- Name the practice being violated and why it matters\n- Give a refactoring suggestion",
                "Line 42: Issue: Mutable variable never reassigned (Low) - declare it final"));
        register(new PromptTemplate(ReviewCategory.ARCHITECTURE,
                "a software architect reviewing architectural soundness and design quality",
                "architectural concern",
                List.of("Design patterns", "Coupling and cohesion", "Abstraction levels and interfaces",
                        "Dependency management and inversion of control", "Layer separation", "Scalability design",
                        "Extensibility", "Component interactions and API design", "Data flow and state",
                        "Technical debt"),
                "- Describe the design issue and its architectural impact\n- Suggest a design improvement",
                "Line 33: Issue: Tight coupling (Medium) - direct database access should be abstracted"));
        register(new PromptTemplate(ReviewCategory.READABILITY,
                "a code readability expert focused on clarity and documentation",
                "readability issue",
                List.of("Code clarity and logic flow", "Variable naming", "Function naming", "Comment quality",
                        "Code organization and formatting", "Documentation", "Nested or complex expressions",
                        "Style consistency", "Magic numbers", "Function and class length"),
                "- Explain the impact on maintainability\n- Provide a clearer alternative",
                "Line 67: Issue: Generic variable name 'data' (Low) - consider 'filteredUsers'"));
        register(new PromptTemplate(ReviewCategory.TESTABILITY,
                "a test engineering expert reviewing testability and test coverage",
                "testability issue",
                List.of("Missing test scenarios and edge cases", "Hard dependencies and mocking difficulty",
                        "Side effect isolation", "Global or shared state", "External dependencies (database, API, file system)",
                        "Error path coverage", "Test data and fixtures", "Observable outcomes", "Test isolation",
                        "Interfaces usable as mock points"),
                "- Identify the testing challenge\n- Suggest a refactoring or a test scenario to add",
                "Line 12: Issue: Hard-coded HTTP client (Medium) - inject it so tests can stub the backend"));
    }

    private PromptTemplates() {
    }

    private static void register(PromptTemplate template) {
        TEMPLATES.put(template.category(), template);
    }

    public static PromptTemplate forCategory(ReviewCategory category) {
        PromptTemplate t = TEMPLATES.get(category);
        if (t == null) {
            throw new IllegalStateException("No prompt template for " + category);
        }
        return t;
    }

    /** System instruction shared by every reviewer. */
    public static String systemPrompt(ReviewCategory category) {
        return "You are a " + category.displayName().toLowerCase() + " expert conducting a thorough code review. "
                + "CRITICAL REQUIREMENTS: 1) ALWAYS scan the ENTIRE code thoroughly for ALL potential issues, "
                + "2) NEVER miss obvious problems, 3) ALWAYS provide specific line numbers for each issue you identify, "
                + "4) Format your response to clearly indicate the line number for each finding "
                + "(e.g., 'Line 15: Issue description'), 5) Be comprehensive and consistent in your analysis.";
    }
}
