package rc_core;

import java.io.Serializable;

/**
 * A real function applied element-wise on a vector (an activation or its inverse).
 */
public interface Transformation extends Serializable {
    double transform(double d);
}
