@NullMarked
package io.regtransport.client.http.jdk;

import org.jspecify.annotations.NullMarked;
