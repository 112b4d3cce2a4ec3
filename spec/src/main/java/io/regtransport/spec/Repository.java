package io.regtransport.spec;

import java.util.regex.Pattern;

import io.regtransport.util.Assert;

/**
 * Names a repository within a registry.
 *
 * @param registry the host of the registry holding the repository
 * @param repository the repository path, e.g. {@code my-project/my-image}
 */
public record Repository(String registry, String repository) implements ResourceName {

    private static final Pattern COMPONENT = Pattern.compile("[a-z0-9]+(?:[._-][a-z0-9]+)*");
    private static final int MAX_LENGTH = 255;

    public Repository {
        Registry.checkRegistry(registry);
        checkRepository(repository);
    }

    public Repository(Registry registry, String repository) {
        this(Assert.checkNotNullParam("registry", registry).registry(), repository);
    }

    /**
     * Parses a name of the form {@code [registry/]path}. The first component is taken as the
     * registry when it contains a {@code .} or {@code :} or is {@code localhost}, otherwise
     * {@link ResourceName#DEFAULT_REGISTRY} is used.
     *
     * @param name the name to parse
     * @return the repository
     * @throws BadNameException if the name is malformed
     */
    public static Repository parse(String name) {
        if (name == null || name.isEmpty()) {
            throw new BadNameException("Repository name may not be empty");
        }
        int slash = name.indexOf('/');
        if (slash > 0) {
            String first = name.substring(0, slash);
            if (first.contains(".") || first.contains(":") || first.equals("localhost")) {
                return new Repository(first, name.substring(slash + 1));
            }
        }
        return new Repository(DEFAULT_REGISTRY, name);
    }

    /**
     * Returns the registry as a resource name of its own.
     *
     * @return the registry
     */
    public Registry asRegistry() {
        return new Registry(registry);
    }

    @Override
    public String scope(Action action) {
        return "repository:" + repository + ":" + action.scope();
    }

    @Override
    public String toString() {
        return registry + "/" + repository;
    }

    private static void checkRepository(String repository) {
        if (repository == null || repository.isEmpty() || repository.length() > MAX_LENGTH) {
            throw new BadNameException("Invalid repository: " + repository);
        }
        for (String component : repository.split("/", -1)) {
            if (!COMPONENT.matcher(component).matches()) {
                throw new BadNameException("Invalid repository: " + repository
                        + ", bad path component '" + component + "'");
            }
        }
    }
}
