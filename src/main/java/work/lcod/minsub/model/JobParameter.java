package work.lcod.minsub.model;

/**
 * Anything that ends up as a named entry in the pipeline environment.
 */
public interface JobParameter {
    String name();

    String environmentValue();
}
