@NullMarked
package io.regtransport.util;

import org.jspecify.annotations.NullMarked;
