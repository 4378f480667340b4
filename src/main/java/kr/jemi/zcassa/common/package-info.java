@ApplicationModule(type = ApplicationModule.Type.OPEN)
package kr.jemi.zcassa.common;

import org.springframework.modulith.ApplicationModule;
